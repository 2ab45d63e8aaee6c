package dev.jobmatcher.model;

public record SalaryRange(Double min, Double max, String currency, String period) {
}
