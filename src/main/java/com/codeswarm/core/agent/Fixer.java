package com.codeswarm.core.agent;

import com.codeswarm.core.fixer.FixReport;
import com.codeswarm.core.plan.Plan;

/**
 * Applies a Plan to a resource set, one resource at a time.
 *
 * Only resources inside the set may be modified; an attempt to write outside
 * it surfaces as a {@link com.codeswarm.core.filesystem.SandboxViolationException}.
 */
@FunctionalInterface
public interface Fixer {

    FixReport fix(ResourceSet resources, Plan plan);
}
