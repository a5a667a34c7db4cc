package com.campusfeedback.backend.service.submission;

import com.campusfeedback.backend.entity.OverrideStudent;
import com.campusfeedback.backend.entity.Student;

/**
 * Whoever holds an access grant: an enrolled student with a full academic graph, or a
 * roster override entered outside enrollment.
 */
public interface Respondent {

    String id();

    record Enrolled(Student student) implements Respondent {
        @Override
        public String id() {
            return student.getId();
        }
    }

    record RosterOverride(OverrideStudent student) implements Respondent {
        @Override
        public String id() {
            return student.getId();
        }
    }
}
