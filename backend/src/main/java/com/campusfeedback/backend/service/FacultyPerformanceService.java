package com.campusfeedback.backend.service;

import com.campusfeedback.backend.dto.FacultyPerformanceDto;
import com.campusfeedback.backend.entity.AcademicYear;
import com.campusfeedback.backend.entity.Faculty;
import com.campusfeedback.backend.entity.FeedbackSnapshot;
import com.campusfeedback.backend.repository.AcademicYearRepository;
import com.campusfeedback.backend.repository.FacultyRepository;
import com.campusfeedback.backend.repository.FeedbackSnapshotRepository;
import com.campusfeedback.backend.service.codec.ResponseValueCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

@Service
@RequiredArgsConstructor
@Slf4j
public class FacultyPerformanceService {

    public static final String CACHE_NAME = "faculty-performance";
    static final String RATING_TYPE = "rating";
    private static final int MAX_SEMESTER = 8;

    private final FeedbackSnapshotRepository feedbackSnapshotRepository;
    private final FacultyRepository facultyRepository;
    private final AcademicYearRepository academicYearRepository;
    private final ResponseValueCodec responseValueCodec;
    private final CacheManager cacheManager;

    @Cacheable(cacheNames = CACHE_NAME, key = "#facultyId + ':' + #academicYearId")
    @Transactional(readOnly = true)
    public FacultyPerformanceDto getFacultyPerformance(String facultyId, String academicYearId) {
        List<FeedbackSnapshot> snapshots = feedbackSnapshotRepository.findForFacultyReport(facultyId, academicYearId, RATING_TYPE);

        if (snapshots.isEmpty()) {
            String facultyName = facultyRepository.findById(facultyId)
                    .filter(f -> !f.isDeleted())
                    .map(Faculty::getName)
                    .orElse("Unknown Faculty");
            String yearString = academicYearRepository.findById(academicYearId)
                    .filter(y -> !y.isDeleted())
                    .map(AcademicYear::getYearString)
                    .orElse("Unknown Academic Year");
            return new FacultyPerformanceDto(facultyId, facultyName, yearString, emptySemesters(), null, 0);
        }

        double[] sums = new double[MAX_SEMESTER + 1];
        int[] counts = new int[MAX_SEMESTER + 1];
        double totalSum = 0;
        int totalCount = 0;

        for (FeedbackSnapshot snapshot : snapshots) {
            OptionalDouble score = responseValueCodec.decode(snapshot.getQuestionType(), snapshot.getResponseValue()).score();
            if (score.isEmpty()) {
                log.warn("Skipping snapshot {}: response value {} is not a score", snapshot.getId(), snapshot.getResponseValue());
                continue;
            }
            int semester = snapshot.getSemesterNumber();
            if (semester >= 1 && semester <= MAX_SEMESTER) {
                sums[semester] += score.getAsDouble();
                counts[semester]++;
            }
            totalSum += score.getAsDouble();
            totalCount++;
        }

        Map<Integer, Double> semesterAverages = emptySemesters();
        for (int semester = 1; semester <= MAX_SEMESTER; semester++) {
            if (counts[semester] > 0) {
                semesterAverages.put(semester, round(sums[semester] / counts[semester]));
            }
        }

        FeedbackSnapshot first = snapshots.get(0);
        Double totalAverage = totalCount > 0 ? round(totalSum / totalCount) : null;
        return new FacultyPerformanceDto(facultyId, first.getFacultyName(), first.getAcademicYearString(),
                semesterAverages, totalAverage, totalCount);
    }

    public void evict(String facultyId, String academicYearId) {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache != null) {
            cache.evict(cacheKey(facultyId, academicYearId));
        }
    }

    static String cacheKey(String facultyId, String academicYearId) {
        return facultyId + ":" + academicYearId;
    }

    private static Map<Integer, Double> emptySemesters() {
        Map<Integer, Double> semesters = new LinkedHashMap<>();
        for (int semester = 1; semester <= MAX_SEMESTER; semester++) {
            semesters.put(semester, null);
        }
        return semesters;
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
