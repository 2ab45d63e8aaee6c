package dev.jobmatcher.model;

public record SalaryEstimate(
        String jobTitle,
        String location,
        Double minSalary,
        Double maxSalary,
        Double medianSalary,
        String currency,
        String period,
        String publisher) {
}
