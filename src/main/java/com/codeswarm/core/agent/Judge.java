package com.codeswarm.core.agent;

import com.codeswarm.core.judge.Verdict;

/**
 * Runs the external validation procedure (a test suite) over a resource set.
 */
@FunctionalInterface
public interface Judge {

    Verdict judge(ResourceSet resources);
}
