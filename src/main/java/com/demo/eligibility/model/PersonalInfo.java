package com.demo.eligibility.model;

import java.time.LocalDate;

public record PersonalInfo(
        String fullName,
        String nationalId,
        LocalDate dateOfBirth,
        String nationality,
        String maritalStatus,
        String gender
) {
    public static final PersonalInfo EMPTY = new PersonalInfo(null, null, null, null, null, null);

    /** Name, national id and date of birth. */
    public int coreFieldCount() {
        int n = 0;
        if (hasText(fullName)) n++;
        if (hasText(nationalId)) n++;
        if (dateOfBirth != null) n++;
        return n;
    }

    /**
     * Fills only the fields that are still empty; extracted values always win.
     */
    public PersonalInfo fillGaps(String name, String id, LocalDate dob, String marital) {
        return new PersonalInfo(
                hasText(fullName) ? fullName : name,
                hasText(nationalId) ? nationalId : id,
                dateOfBirth != null ? dateOfBirth : dob,
                nationality,
                hasText(maritalStatus) ? maritalStatus : marital,
                gender
        );
    }

    static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
