package io.b2mash.boq.submission;

import io.b2mash.boq.material.Material;

/** Outcome of approving a submission: the now-terminal submission and the material it produced. */
public record SubmissionApproval(MaterialSubmission submission, Material material) {}
