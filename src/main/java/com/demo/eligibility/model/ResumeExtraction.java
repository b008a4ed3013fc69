package com.demo.eligibility.model;

import java.util.List;

public record ResumeExtraction(
        List<WorkExperience> workExperience,
        List<String> education,
        List<String> skills
) {
    public ResumeExtraction {
        workExperience = workExperience == null ? List.of() : List.copyOf(workExperience);
        education = education == null ? List.of() : List.copyOf(education);
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
