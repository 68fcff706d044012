package org.hackvm.junit.extensions.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.helpers.MessageFormatter;

import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Fails a test when it logs at WARN or above (or the level set by {@link FailOnLog})
 * unless the event is covered by {@link AllowLog} or {@link ExpectLog}. Expected logs
 * that did not occur fail the test as well. Allowed and expected events are kept off
 * the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        TestScopedTurboFilter filter = new TestScopedTurboFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        TestScopedTurboFilter filter = context.getStore(NAMESPACE).get("filter", TestScopedTurboFilter.class);
        if (filter != null) {
            filter.rules = resolveRules(context);
            filter.events.clear();
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        TestScopedTurboFilter filter = context.getStore(NAMESPACE).get("filter", TestScopedTurboFilter.class);
        if (filter == null) {
            return;
        }
        Rules rules = filter.rules;
        List<CapturedEvent> events = new ArrayList<>(filter.events);
        filter.events.clear();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent e : events) {
                if (e.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.covers(e)) {
                    problems.add("Unexpected log: " + e);
                }
            }
        }
        for (Rule expected : rules.expects) {
            long count = events.stream().filter(expected::matches).count();
            if (count < expected.occurrences) {
                problems.add(String.format("Missing expected log: %d x %s, found %d", expected.occurrences, expected, count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        TestScopedTurboFilter filter = context.getStore(NAMESPACE).remove("filter", TestScopedTurboFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        List<AnnotatedElement> sources = new ArrayList<>();
        context.getTestClass().ifPresent(sources::add);
        context.getTestMethod().ifPresent(sources::add);

        List<Rule> allows = new ArrayList<>();
        List<Rule> expects = new ArrayList<>();
        for (AnnotatedElement source : sources) {
            for (AllowLog a : source.getAnnotationsByType(AllowLog.class)) {
                allows.add(new Rule(a.level(), a.loggerPattern(), a.messagePattern(), 0));
            }
            for (ExpectLog e : source.getAnnotationsByType(ExpectLog.class)) {
                expects.add(new Rule(e.level(), e.loggerPattern(), e.messagePattern(), e.occurrences()));
            }
        }
        return new Rules(fail != null ? fail.level() : LogLevel.WARN, fail != null && fail.disabled(), allows, expects);
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Rule(LogLevel level, String loggerPattern, String messagePattern, int occurrences) {
        boolean matches(CapturedEvent e) {
            return e.level.isGreaterOrEqual(toLogback(level))
                    && Pattern.matches(loggerPattern, e.loggerName)
                    && Pattern.matches(messagePattern, e.message);
        }

        @Override
        public String toString() {
            return String.format("[%s] logger=\"%s\" message=\"%s\"", level, loggerPattern, messagePattern);
        }
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<Rule> allows, List<Rule> expects) {
        boolean covers(CapturedEvent e) {
            return allows.stream().anyMatch(r -> r.matches(e)) || expects.stream().anyMatch(r -> r.matches(e));
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static class TestScopedTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        TestScopedTurboFilter(Rules rules) {
            this.rules = rules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            return rules.covers(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }
    }
}
