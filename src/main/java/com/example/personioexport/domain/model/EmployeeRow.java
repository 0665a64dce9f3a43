package com.example.personioexport.domain.model;

import java.util.List;

/**
 * Flattened employee row written to {@code personio_employee_export.csv}.
 * Field order and header names form schema version {@value #SCHEMA_VERSION}; every value is a
 * formatted string and missing values are empty strings.
 */
public record EmployeeRow(
        String employeeId,
        String firstName,
        String lastName,
        String email,
        String status,
        String hireDate,
        String terminationDate,
        String position,
        String department,
        String team,
        String supervisorName,
        String location,
        String weeklyWorkingHours,
        String employmentType,
        String costCenter,
        String baseSalary,
        String lastModified
) {

    public static final String SCHEMA_VERSION = "1";

    public static final List<String> HEADERS = List.of(
            "employeeID",
            "First name",
            "Last name",
            "email",
            "status",
            "Hire date",
            "Termination date",
            "position",
            "department",
            "team",
            "Supervisor name",
            "location",
            "Weekly working hours",
            "Employment type",
            "Cost center",
            "Base Salary",
            "Last modified"
    );

    public EmployeeRow {
        employeeId = blankIfNull(employeeId);
        firstName = blankIfNull(firstName);
        lastName = blankIfNull(lastName);
        email = blankIfNull(email);
        status = blankIfNull(status);
        hireDate = blankIfNull(hireDate);
        terminationDate = blankIfNull(terminationDate);
        position = blankIfNull(position);
        department = blankIfNull(department);
        team = blankIfNull(team);
        supervisorName = blankIfNull(supervisorName);
        location = blankIfNull(location);
        weeklyWorkingHours = blankIfNull(weeklyWorkingHours);
        employmentType = blankIfNull(employmentType);
        costCenter = blankIfNull(costCenter);
        baseSalary = blankIfNull(baseSalary);
        lastModified = blankIfNull(lastModified);
    }

	/**
	 * Returns the values in {@link #HEADERS} order.
	 *
	 * @return immutable list with one entry per column
	 */
    public List<String> values() {
        return List.of(
                employeeId,
                firstName,
                lastName,
                email,
                status,
                hireDate,
                terminationDate,
                position,
                department,
                team,
                supervisorName,
                location,
                weeklyWorkingHours,
                employmentType,
                costCenter,
                baseSalary,
                lastModified
        );
    }

    private static String blankIfNull(String value) {
        return value == null ? "" : value;
    }
}
