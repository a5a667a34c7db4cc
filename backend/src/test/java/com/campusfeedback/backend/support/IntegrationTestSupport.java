package com.campusfeedback.backend.support;

import com.campusfeedback.backend.entity.*;
import com.campusfeedback.backend.repository.*;
import com.campusfeedback.backend.service.FacultyPerformanceService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared fixture for tests running against the in-memory database. Nothing here is
 * transactional: submissions commit for real and every table is wiped after each test.
 */
public abstract class IntegrationTestSupport {

    @Autowired protected AcademicYearRepository academicYearRepository;
    @Autowired protected DepartmentRepository departmentRepository;
    @Autowired protected SemesterRepository semesterRepository;
    @Autowired protected DivisionRepository divisionRepository;
    @Autowired protected SubjectRepository subjectRepository;
    @Autowired protected FacultyRepository facultyRepository;
    @Autowired protected SubjectAllocationRepository subjectAllocationRepository;
    @Autowired protected FeedbackFormRepository feedbackFormRepository;
    @Autowired protected QuestionCategoryRepository questionCategoryRepository;
    @Autowired protected FeedbackQuestionRepository feedbackQuestionRepository;
    @Autowired protected StudentRepository studentRepository;
    @Autowired protected OverrideStudentRepository overrideStudentRepository;
    @Autowired protected FormAccessRepository formAccessRepository;
    @Autowired protected StudentResponseRepository studentResponseRepository;
    @Autowired protected FeedbackSnapshotRepository feedbackSnapshotRepository;
    @Autowired protected CacheManager cacheManager;
    @Autowired protected ObjectMapper objectMapper;
    @Autowired protected MutableClock clock;

    protected AcademicYear academicYear;
    protected Department department;
    protected Semester semester;
    protected Division division;
    protected Faculty faculty;
    protected Subject subject;
    protected SubjectAllocation allocation;
    protected QuestionCategory category;

    private int enrollmentSequence;

    @BeforeEach
    void createAcademicStructure() {
        clock.setTo(TestClockConfig.START);
        Cache cache = cacheManager.getCache(FacultyPerformanceService.CACHE_NAME);
        if (cache != null) {
            cache.clear();
        }

        academicYear = academicYearRepository.save(new AcademicYear("2025-26"));
        department = departmentRepository.save(new Department("Computer Engineering", "CE"));
        semester = semesterRepository.save(new Semester(5, department, academicYear));
        division = divisionRepository.save(new Division("A", semester));
        faculty = facultyRepository.save(new Faculty("Asha Mehta", "asha.mehta@college.edu", "AM"));
        subject = subjectRepository.save(new Subject("Operating Systems", "OS", "CE501"));
        allocation = subjectAllocationRepository.save(
                new SubjectAllocation(faculty, subject, division, academicYear, LectureType.LECTURE));
        category = questionCategoryRepository.save(new QuestionCategory("Teaching", "Delivery and clarity"));
    }

    @AfterEach
    void cleanDatabase() {
        feedbackSnapshotRepository.deleteAll();
        studentResponseRepository.deleteAllInBatch();
        formAccessRepository.deleteAllInBatch();
        feedbackQuestionRepository.deleteAllInBatch();
        feedbackFormRepository.deleteAllInBatch();
        subjectAllocationRepository.deleteAllInBatch();
        studentRepository.deleteAllInBatch();
        overrideStudentRepository.deleteAllInBatch();
        questionCategoryRepository.deleteAllInBatch();
        divisionRepository.deleteAllInBatch();
        semesterRepository.deleteAllInBatch();
        departmentRepository.deleteAllInBatch();
        academicYearRepository.deleteAllInBatch();
        facultyRepository.deleteAllInBatch();
        subjectRepository.deleteAllInBatch();
    }

    protected FeedbackForm activeForm(String title) {
        return feedbackFormRepository.save(new FeedbackForm(title, FormStatus.ACTIVE, allocation));
    }

    protected FeedbackForm save(FeedbackForm form) {
        return feedbackFormRepository.save(form);
    }

    protected FeedbackQuestion question(FeedbackForm form, String text, String type) {
        return feedbackQuestionRepository.save(
                new FeedbackQuestion(form, category, faculty, subject, text, type, "B1", 0));
    }

    protected Student enrolledStudent(String name) {
        enrollmentSequence++;
        String enrollment = String.format("22CE%03d", enrollmentSequence);
        return studentRepository.save(new Student(enrollment, name,
                name.toLowerCase().replace(' ', '.') + "@student.college.edu", "B1",
                academicYear, semester, division));
    }

    protected OverrideStudent overrideStudent(String name, String department, String semester) {
        return overrideStudentRepository.save(new OverrideStudent("EXT-" + name.hashCode(), name,
                name.toLowerCase().replace(' ', '.') + "@guest.college.edu", department, semester));
    }

    protected FormAccess grant(String token, FeedbackForm form, Student student) {
        return formAccessRepository.save(new FormAccess(token, form, student, null));
    }

    protected FormAccess grant(String token, FeedbackForm form, OverrideStudent overrideStudent) {
        return formAccessRepository.save(new FormAccess(token, form, null, overrideStudent));
    }

    protected boolean isSubmitted(String token) {
        return formAccessRepository.findByAccessToken(token).orElseThrow().isSubmitted();
    }

    protected Map<String, JsonNode> answers(Object... idValuePairs) {
        Map<String, JsonNode> answers = new LinkedHashMap<>();
        for (int i = 0; i < idValuePairs.length; i += 2) {
            answers.put((String) idValuePairs[i], objectMapper.valueToTree(idValuePairs[i + 1]));
        }
        return answers;
    }
}
