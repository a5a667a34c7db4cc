package com.campusfeedback.backend.service.submission;

import com.campusfeedback.backend.entity.AcademicYear;
import com.campusfeedback.backend.entity.Department;
import com.campusfeedback.backend.entity.Division;
import com.campusfeedback.backend.entity.OverrideStudent;
import com.campusfeedback.backend.entity.Semester;

/**
 * Academic year / department / semester / division fields copied onto every snapshot of
 * one submission.
 */
public record AcademicContext(
        String academicYearId,
        String academicYearString,
        boolean academicYearDeleted,
        String departmentId,
        String departmentName,
        String departmentAbbreviation,
        boolean departmentDeleted,
        String semesterId,
        int semesterNumber,
        boolean semesterDeleted,
        String divisionId,
        String divisionName,
        boolean divisionDeleted
) {

    public static AcademicContext of(AcademicYear academicYear, Semester semester, Division division) {
        Department department = semester.getDepartment();
        return new AcademicContext(
                academicYear.getId(),
                academicYear.getYearString(),
                academicYear.isDeleted(),
                department.getId(),
                nullToEmpty(department.getName()),
                nullToEmpty(department.getAbbreviation()),
                department.isDeleted(),
                semester.getId(),
                semester.getSemesterNumber(),
                semester.isDeleted(),
                division.getId(),
                division.getDivisionName(),
                division.isDeleted()
        );
    }

    /** A division with its semester, department and academic year already loaded. */
    public static AcademicContext ofDivision(Division division) {
        Semester semester = division.getSemester();
        return of(semester.getAcademicYear(), semester, division);
    }

    /** Used when an override student's cohort cannot be found: only their own free text survives. */
    public static AcademicContext fallbackFor(OverrideStudent student) {
        return new AcademicContext(
                "", "", false,
                "", nullToEmpty(student.getDepartment()), "", false,
                "", parseSemesterNumber(student.getSemester()), false,
                "", "", false
        );
    }

    // leading digits only, so "5th" reads as 5
    static int parseSemesterNumber(String semester) {
        if (semester == null) {
            return 0;
        }
        String trimmed = semester.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isDigit(trimmed.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return 0;
        }
        try {
            return Integer.parseInt(trimmed.substring(0, end));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
