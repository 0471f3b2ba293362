package io.b2mash.boq.submission;

/** A submission joined with its template's name and code and its shop's name. */
public record SubmissionWithNames(
    MaterialSubmission submission, String templateName, String templateCode, String shopName) {}
