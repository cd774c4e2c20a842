package com.flightdeck.core.lessons;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of the lesson store: {@code {version, lessons}}.
 */
public class LessonsDocument {

    public static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private List<Lesson> lessons = new ArrayList<>();

    public LessonsDocument() {}

    public LessonsDocument(int version, List<Lesson> lessons) {
        this.version = version;
        this.lessons = new ArrayList<>(lessons);
    }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }
    public List<Lesson> getLessons() { return lessons; }
    public void setLessons(List<Lesson> lessons) { this.lessons = lessons != null ? lessons : new ArrayList<>(); }
}
