package com.codeswarm.core.agent;

import com.codeswarm.core.plan.Plan;

/**
 * Finds issues in a resource set.
 *
 * Implementations fail closed: an internal error for one resource leaves that
 * resource out of the Plan instead of raising. Identical input must yield an
 * identical Plan.
 */
@FunctionalInterface
public interface Auditor {

    Plan audit(ResourceSet resources);
}
