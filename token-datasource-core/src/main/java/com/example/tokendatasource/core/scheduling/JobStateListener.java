package com.example.tokendatasource.core.scheduling;

/** Observes job state transitions. Called on the thread performing the transition. */
@FunctionalInterface
public interface JobStateListener {

  JobStateListener NONE = (jobId, from, to) -> {};

  void onTransition(final String jobId, final JobState from, final JobState to);
}
