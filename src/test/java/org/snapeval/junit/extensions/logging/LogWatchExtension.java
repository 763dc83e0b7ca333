package org.snapeval.junit.extensions.logging;

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

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Fails a test that logs at WARN or above unless the event is covered by {@link AllowLog} or
 * {@link ExpectLog}, and fails it when an {@link ExpectLog} event is missing. Events are
 * captured with a Logback turbo filter, so they are seen from every thread.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);
    private static final String FILTER_KEY = "filter";

    @Override
    public void beforeAll(ExtensionContext context) {
        CapturingTurboFilter filter = new CapturingTurboFilter(resolveRules(context));
        filter.start();
        loggerContext().addTurboFilter(filter);
        context.getStore(NAMESPACE).put(FILTER_KEY, filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingTurboFilter filter = filter(context);
        if (filter != null) {
            filter.clearEvents();
            filter.updateRules(resolveRules(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = filter(context);
        if (filter == null) {
            return;
        }
        Rules rules = resolveRules(context);
        List<CapturedEvent> events = filter.getCapturedEvents();
        filter.clearEvents();

        List<String> problems = new ArrayList<>();
        if (!rules.disabled()) {
            for (CapturedEvent event : events) {
                if (event.level().isGreaterOrEqual(toLogback(rules.minLevel())) && !rules.covers(event)) {
                    problems.add("Unexpected log: " + event);
                }
            }
        }
        for (ExpectLog expect : rules.expects()) {
            long count = events.stream().filter(e -> matches(e, expect.level(), expect.loggerPattern(), expect.messagePattern())).count();
            if (count < expect.occurrences()) {
                problems.add(String.format("Missing expected log: %d x [%s] logger=\"%s\" message=\"%s\", found %d",
                        expect.occurrences(), expect.level(), expect.loggerPattern(), expect.messagePattern(), count));
            }
        }
        if (!problems.isEmpty()) {
            throw new AssertionError(String.join("\n", problems));
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove(FILTER_KEY, CapturingTurboFilter.class);
        if (filter != null) {
            loggerContext().getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static CapturingTurboFilter filter(ExtensionContext context) {
        return context.getStore(NAMESPACE).get(FILTER_KEY, CapturingTurboFilter.class);
    }

    private static LoggerContext loggerContext() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new Rules(minLevel, disabled,
                collect(context, el -> el.getAnnotationsByType(AllowLog.class)),
                collect(context, el -> el.getAnnotationsByType(ExpectLog.class)));
    }

    // Class-level annotations first, then those on the test method; nested classes see their enclosing class too.
    private static <A extends Annotation> List<A> collect(ExtensionContext context, Function<AnnotatedElement, A[]> lookup) {
        List<A> result = new ArrayList<>();
        context.getTestClass().ifPresent(c -> {
            for (Class<?> current = c; current != null; current = current.getEnclosingClass()) {
                result.addAll(List.of(lookup.apply(current)));
            }
        });
        context.getTestMethod().ifPresent(m -> result.addAll(List.of(lookup.apply(m))));
        return result;
    }

    private static boolean matches(CapturedEvent event, LogLevel level, String loggerPattern, String messagePattern) {
        return event.level().isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, event.loggerName())
                && Pattern.matches(messagePattern, event.message());
    }

    private static Level toLogback(LogLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
    }

    private record Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {

        boolean covers(CapturedEvent event) {
            return allows.stream().anyMatch(a -> matches(event, a.level(), a.loggerPattern(), a.messagePattern()))
                    || expects.stream().anyMatch(e -> matches(event, e.level(), e.loggerPattern(), e.messagePattern()));
        }
    }

    private record CapturedEvent(String loggerName, Level level, String message) {
        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static final class CapturingTurboFilter extends TurboFilter {
        private final List<CapturedEvent> events = new CopyOnWriteArrayList<>();
        private volatile Rules rules;

        CapturingTurboFilter(Rules rules) {
            this.rules = rules;
        }

        void updateRules(Rules newRules) {
            this.rules = newRules;
        }

        @Override
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level,
                                  String format, Object[] params, Throwable t) {
            // Called once per logging call, before the logger's level is checked.
            if (format == null || !level.isGreaterOrEqual(Level.INFO)) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent event = new CapturedEvent(logger.getName(), level,
                    MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(event);
            // Allowed and expected events stay out of the build output.
            return rules.covers(event) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<CapturedEvent> getCapturedEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }
}
