package net.gantry.core.service;

import net.gantry.core.model.Job;

public record SubmitResult(boolean accepted, String jobId, Job.Status status) {}
