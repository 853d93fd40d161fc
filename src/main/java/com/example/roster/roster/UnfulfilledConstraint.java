package com.example.roster.roster;

public record UnfulfilledConstraint(String personId, String personName, String date, String type, String reason) {
}
