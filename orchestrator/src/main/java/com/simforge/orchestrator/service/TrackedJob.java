package com.simforge.orchestrator.service;

import com.simforge.orchestrator.model.Job;
import com.simforge.orchestrator.progress.ProgressLog;

/** A submitted job together with the progress events recorded for it. */
public record TrackedJob(Job job, ProgressLog progress) {}
