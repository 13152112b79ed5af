package com.arbor.tree;

/**
 * Body of a {@link Job}. Runs on an executor thread; the returned value becomes the job's result
 * once all of its children resolved. A thrown exception fails the job.
 */
@FunctionalInterface
public interface JobBody {

    Object run(JobContext context) throws Exception;
}
