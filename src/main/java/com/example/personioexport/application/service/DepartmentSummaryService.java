package com.example.personioexport.application.service;

import com.example.personioexport.domain.model.DepartmentStat;
import com.example.personioexport.domain.model.EmployeeRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives department-level statistics from the flattened employee rows.
 */
@Service
public class DepartmentSummaryService {

    public static final String UNKNOWN_DEPARTMENT = "Unknown";

    private static final Logger log = LoggerFactory.getLogger(DepartmentSummaryService.class);

	/**
	 * Groups rows by department and averages their base salaries.
	 * Departments compare case-sensitively after whitespace is trimmed and collapsed; blank
	 * departments fall into {@value #UNKNOWN_DEPARTMENT}. Rows without a parseable salary count
	 * towards the head count but not the average.
	 *
	 * @param rows full row set of the run
	 * @return one stat per department, sorted by department name
	 */
    public List<DepartmentStat> summarize(List<EmployeeRow> rows) {
        log.info("Generating department summary...");
        Map<String, Bucket> buckets = new TreeMap<>();
        for (EmployeeRow row : rows) {
            buckets.computeIfAbsent(bucketName(row.department()), name -> new Bucket()).add(row.baseSalary());
        }

        List<DepartmentStat> stats = new ArrayList<>(buckets.size());
        buckets.forEach((department, bucket) -> stats.add(bucket.toStat(department)));
        return stats;
    }

    private String bucketName(String department) {
        String normalized = department == null ? "" : department.strip().replaceAll("\\s+", " ");
        return normalized.isEmpty() ? UNKNOWN_DEPARTMENT : normalized;
    }

    private static final class Bucket {

        private int employees;
        private int salaried;
        private BigDecimal salaryTotal = BigDecimal.ZERO;

        private void add(String baseSalary) {
            employees++;
            if (baseSalary == null || baseSalary.isBlank()) {
                return;
            }
            try {
                salaryTotal = salaryTotal.add(new BigDecimal(baseSalary.strip()));
                salaried++;
            } catch (NumberFormatException ex) {
                log.debug("Ignoring unparseable base salary '{}'", baseSalary);
            }
        }

        private DepartmentStat toStat(String department) {
            BigDecimal average = salaried == 0
                    ? null
                    : salaryTotal.divide(BigDecimal.valueOf(salaried), 2, RoundingMode.HALF_UP);
            return new DepartmentStat(department, employees, average);
        }
    }
}
