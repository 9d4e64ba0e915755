package com.simforge.orchestrator.stage;

import java.time.Duration;

/** Output of one successful stage execution and how long it took. */
public record StageResult<O>(O output, Duration elapsed) {}
