package com.example.personioexport.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * One line of {@code department_summary.csv}.
 *
 * @param department        department bucket name
 * @param employeeCount     number of rows in the bucket
 * @param averageBaseSalary average over rows with a salary, {@code null} when none had one
 */
public record DepartmentStat(String department, int employeeCount, BigDecimal averageBaseSalary) {

    public static final List<String> HEADERS = List.of("department", "employee_count", "average_base_salary");

	/**
	 * @return CSV values in {@link #HEADERS} order, with an empty average when undefined
	 */
    public List<String> values() {
        return List.of(
                department,
                String.valueOf(employeeCount),
                averageBaseSalary == null ? "" : averageBaseSalary.toPlainString()
        );
    }
}
