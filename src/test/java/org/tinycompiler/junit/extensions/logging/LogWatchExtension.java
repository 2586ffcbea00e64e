package org.tinycompiler.junit.extensions.logging;

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
 * Watches Logback while a test class runs and fails a test that logs at WARN or above
 * unless the event is covered by {@link AllowLog} or {@link ExpectLog}. Missing
 * expected events fail the test as well. Allowed and expected events are kept off the console.
 */
public class LogWatchExtension implements BeforeAllCallback, BeforeEachCallback, AfterEachCallback, AfterAllCallback {

    private static final ExtensionContext.Namespace NAMESPACE = ExtensionContext.Namespace.create(LogWatchExtension.class);

    @Override
    public void beforeAll(ExtensionContext context) {
        LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
        CapturingTurboFilter filter = new CapturingTurboFilter(resolveRules(context));
        filter.start();
        lc.addTurboFilter(filter);
        context.getStore(NAMESPACE).put("filter", filter);
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).get("filter", CapturingTurboFilter.class);
        if (filter != null) {
            filter.clearEvents();
            filter.updateRules(resolveRules(context));
        }
    }

    @Override
    public void afterEach(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).get("filter", CapturingTurboFilter.class);
        if (filter == null) {
            return;
        }

        Rules rules = resolveRules(context);
        List<CapturedEvent> events = filter.getCapturedEvents();
        filter.clearEvents();

        List<String> unexpected = new ArrayList<>();
        if (!rules.disabled) {
            for (CapturedEvent e : events) {
                if (e.level.isGreaterOrEqual(toLogback(rules.minLevel)) && !rules.covers(e)) {
                    unexpected.add(e.toString());
                }
            }
        }

        List<String> missing = new ArrayList<>();
        for (ExpectLog exp : rules.expects) {
            long count = events.stream().filter(e -> matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())).count();
            if (count < exp.occurrences()) {
                missing.add(String.format("Expected %d x [%s] logger=\"%s\" message=\"%s\", but found %d.",
                        exp.occurrences(), exp.level(), exp.loggerPattern(), exp.messagePattern(), count));
            }
        }

        if (!unexpected.isEmpty() || !missing.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            if (!unexpected.isEmpty()) {
                sb.append("Unexpected logs:\n");
                unexpected.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            if (!missing.isEmpty()) {
                sb.append("Missing expected logs:\n");
                missing.forEach(msg -> sb.append("  ").append(msg).append('\n'));
            }
            throw new AssertionError(sb.toString());
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        CapturingTurboFilter filter = context.getStore(NAMESPACE).remove("filter", CapturingTurboFilter.class);
        if (filter != null) {
            LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
            lc.getTurboFilterList().remove(filter);
            filter.stop();
        }
    }

    private static Rules resolveRules(ExtensionContext context) {
        FailOnLog fail = context.getElement().map(el -> el.getAnnotation(FailOnLog.class))
                .orElse(context.getTestClass().map(c -> c.getAnnotation(FailOnLog.class)).orElse(null));
        List<AllowLog> allows = new ArrayList<>();
        List<ExpectLog> expects = new ArrayList<>();
        context.getTestClass().ifPresent(c -> collect(c, allows, expects));
        context.getTestMethod().ifPresent(m -> collect(m, allows, expects));

        LogLevel minLevel = fail != null ? fail.level() : LogLevel.WARN;
        boolean disabled = fail != null && fail.disabled();
        return new Rules(minLevel, disabled, allows, expects);
    }

    private static void collect(AnnotatedElement element, List<AllowLog> allows, List<ExpectLog> expects) {
        allows.addAll(List.of(element.getAnnotationsByType(AllowLog.class)));
        expects.addAll(List.of(element.getAnnotationsByType(ExpectLog.class)));
    }

    private static boolean matches(CapturedEvent e, LogLevel level, String loggerPattern, String messagePattern) {
        return e.level.isGreaterOrEqual(toLogback(level))
                && Pattern.matches(loggerPattern, e.loggerName)
                && Pattern.compile(messagePattern, Pattern.DOTALL).matcher(e.message).matches();
    }

    private static Level toLogback(LogLevel lvl) {
        return switch (lvl) {
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR -> Level.ERROR;
        };
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
        public FilterReply decide(Marker marker, ch.qos.logback.classic.Logger logger, Level level, String format, Object[] params, Throwable t) {
            // Level checks such as isDebugEnabled() arrive without a format.
            if (format == null || !level.isGreaterOrEqual(Level.INFO) || !level.isGreaterOrEqual(logger.getEffectiveLevel())) {
                return FilterReply.NEUTRAL;
            }
            CapturedEvent ev = new CapturedEvent(logger.getName(), level, MessageFormatter.arrayFormat(format, params).getMessage());
            events.add(ev);
            return rules.covers(ev) ? FilterReply.DENY : FilterReply.NEUTRAL;
        }

        List<CapturedEvent> getCapturedEvents() {
            return new ArrayList<>(events);
        }

        void clearEvents() {
            events.clear();
        }
    }

    private static final class CapturedEvent {
        final String loggerName;
        final Level level;
        final String message;

        CapturedEvent(String loggerName, Level level, String message) {
            this.loggerName = loggerName;
            this.level = level;
            this.message = message != null ? message : "";
        }

        @Override
        public String toString() {
            return String.format("[%s] %s - %s", level, loggerName, message);
        }
    }

    private static final class Rules {
        final LogLevel minLevel;
        final boolean disabled;
        final List<AllowLog> allows;
        final List<ExpectLog> expects;

        Rules(LogLevel minLevel, boolean disabled, List<AllowLog> allows, List<ExpectLog> expects) {
            this.minLevel = minLevel;
            this.disabled = disabled;
            this.allows = allows;
            this.expects = expects;
        }

        boolean covers(CapturedEvent e) {
            for (AllowLog a : allows) {
                if (matches(e, a.level(), a.loggerPattern(), a.messagePattern())) {
                    return true;
                }
            }
            for (ExpectLog exp : expects) {
                if (matches(e, exp.level(), exp.loggerPattern(), exp.messagePattern())) {
                    return true;
                }
            }
            return false;
        }
    }
}
