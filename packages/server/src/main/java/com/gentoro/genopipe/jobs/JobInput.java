package com.gentoro.genopipe.jobs;

/** Marker for the typed input of a job submission. */
public interface JobInput {}
