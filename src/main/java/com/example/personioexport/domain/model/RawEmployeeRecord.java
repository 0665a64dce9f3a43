package com.example.personioexport.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.List;

/**
 * Raw, still nested view of one employee as returned by the Personio API.
 * Master data is always present; employment and compensation lists are empty when the
 * corresponding resource held nothing for this employee.
 *
 * @param employeeId    join key, blank when the master record carried no identifier
 * @param masterData    employee master record
 * @param employments   employment detail records in server order
 * @param compensations compensation records in server order
 */
public record RawEmployeeRecord(
        String employeeId,
        JsonNode masterData,
        List<JsonNode> employments,
        List<JsonNode> compensations
) {

    public RawEmployeeRecord {
        employeeId = employeeId == null ? "" : employeeId;
        masterData = masterData == null ? MissingNode.getInstance() : masterData;
        employments = employments == null ? List.of() : List.copyOf(employments);
        compensations = compensations == null ? List.of() : List.copyOf(compensations);
    }

	/**
	 * @return first employment record, or a missing node when the employee has none
	 */
    public JsonNode primaryEmployment() {
        return employments.isEmpty() ? MissingNode.getInstance() : employments.get(0);
    }
}
