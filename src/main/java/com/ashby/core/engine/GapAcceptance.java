package com.ashby.core.engine;

import java.util.List;

/**
 * Answer to a gap injection.
 *
 * @param accepted     whether the gap was taken into the acquisition loop
 * @param capabilities the normalized capability names it named
 * @param started      capabilities for which a new attempt was started
 */
public record GapAcceptance(boolean accepted, List<String> capabilities, List<String> started) {}
