package com.example.cicdbackend.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of an approval's manual test checklist,
 * e.g. {"name": "Login works", "passed": true, "notes": "OK"}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualTestItem {

    private String name;

    private Boolean passed;

    private String notes;
}
