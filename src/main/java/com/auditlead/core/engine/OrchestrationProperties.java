package com.auditlead.core.engine;

import com.auditlead.core.agent.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "auditlead")
public class OrchestrationProperties {

    private Agent agent = new Agent();
    private Run run = new Run();
    private Bus bus = new Bus();
    private Context context = new Context();

    // -- Flat accessors (delegate to nested) --
    public int getMaxRetries() { return agent.maxRetries; }
    public Duration getRetryDelay() { return agent.retryDelay; }
    public Duration getRunTimeout() { return run.timeout; }
    public int getMaxParallel() { return run.maxParallel; }
    public int getHistoryLimit() { return bus.historyLimit; }
    public int getTextBudget() { return context.textBudget; }

    /** Retry policy applied to agents that do not declare their own. */
    public RetryPolicy defaultRetryPolicy() {
        return new RetryPolicy(agent.maxRetries, agent.retryDelay);
    }

    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
    public Bus getBus() { return bus; }
    public void setBus(Bus bus) { this.bus = bus; }
    public Context getContext() { return context; }
    public void setContext(Context context) { this.context = context; }

    public static class Agent {
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(2);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
    }

    public static class Run {
        private Duration timeout = Duration.ofMinutes(45);
        private int maxParallel = 8;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }

    public static class Bus {
        private int historyLimit = 10_000;

        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
    }

    public static class Context {
        /** Default character budget for aggregated artifact text. */
        private int textBudget = 50_000;

        public int getTextBudget() { return textBudget; }
        public void setTextBudget(int textBudget) { this.textBudget = textBudget; }
    }
}
