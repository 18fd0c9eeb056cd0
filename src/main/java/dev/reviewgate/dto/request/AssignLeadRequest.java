package dev.reviewgate.dto.request;

/** A null leadId clears the lead. */
public record AssignLeadRequest(String leadId) {}
