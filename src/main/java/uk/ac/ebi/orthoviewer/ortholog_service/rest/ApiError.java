package uk.ac.ebi.orthoviewer.ortholog_service.rest;

public record ApiError(
    String code,
    String field,
    String message,
    Integer httpStatus
) {}
