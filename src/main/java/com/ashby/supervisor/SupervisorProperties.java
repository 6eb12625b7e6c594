package com.ashby.supervisor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ashby.supervisor")
public class SupervisorProperties {

    /** How long spawn watches for an immediate exit before declaring the process running. */
    private Duration startupGrace = Duration.ofMillis(500);
    /** Grace period between a polite destroy and a forcible one. */
    private Duration stopTimeout = Duration.ofSeconds(5);
    private int stderrTailLines = 200;
    private int recentExitsLimit = 50;
    private String nodeCommand = "node";

    public Duration getStartupGrace() { return startupGrace; }
    public void setStartupGrace(Duration startupGrace) { this.startupGrace = startupGrace; }
    public Duration getStopTimeout() { return stopTimeout; }
    public void setStopTimeout(Duration stopTimeout) { this.stopTimeout = stopTimeout; }
    public int getStderrTailLines() { return stderrTailLines; }
    public void setStderrTailLines(int stderrTailLines) { this.stderrTailLines = stderrTailLines; }
    public int getRecentExitsLimit() { return recentExitsLimit; }
    public void setRecentExitsLimit(int recentExitsLimit) { this.recentExitsLimit = recentExitsLimit; }
    public String getNodeCommand() { return nodeCommand; }
    public void setNodeCommand(String nodeCommand) { this.nodeCommand = nodeCommand; }
}
