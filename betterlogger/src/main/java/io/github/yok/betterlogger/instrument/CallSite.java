package io.github.yok.betterlogger.instrument;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Describes one instrumented call: the function name plus its positional and named arguments,
 * already rendered as text.
 *
 * <pre>
 * CallSite site = CallSite.builder("greet").arg("Bob").namedArg("greeting", "Hi").build();
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
@EqualsAndHashCode
public final class CallSite {

    private final String name;
    private final List<String> positionalArgs;
    private final Map<String, String> namedArgs;

    private CallSite(String name, List<String> positionalArgs, Map<String, String> namedArgs) {
        this.name = name;
        this.positionalArgs = Collections.unmodifiableList(new ArrayList<>(positionalArgs));
        this.namedArgs = Collections.unmodifiableMap(new LinkedHashMap<>(namedArgs));
    }

    /**
     * Creates a call site with positional arguments only.
     *
     * @param name function name
     * @param args positional arguments
     * @return call site
     */
    public static CallSite of(String name, Object... args) {
        Builder builder = builder(name);
        for (Object arg : args) {
            builder.arg(arg);
        }
        return builder.build();
    }

    /**
     * Starts a builder.
     *
     * @param name function name
     * @return builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<String> getPositionalArgs() {
        return positionalArgs;
    }

    public Map<String, String> getNamedArgs() {
        return namedArgs;
    }

    /**
     * Renders an argument or result value. Arrays are rendered element by element.
     *
     * @param value value to render
     * @return text form
     */
    public static String describe(Object value) {
        if (value != null && value.getClass().isArray()) {
            String wrapped = Arrays.deepToString(new Object[] {value});
            return wrapped.substring(1, wrapped.length() - 1);
        }
        return String.valueOf(value);
    }

    /**
     * Builder for {@link CallSite}.
     */
    public static final class Builder {

        private final String name;
        private final List<String> positionalArgs = new ArrayList<>();
        private final Map<String, String> namedArgs = new LinkedHashMap<>();

        private Builder(String name) {
            Preconditions.checkArgument(StringUtils.isNotBlank(name), "name must not be blank");
            this.name = name;
        }

        /**
         * Adds a positional argument.
         *
         * @param value argument value
         * @return this builder
         */
        public Builder arg(Object value) {
            positionalArgs.add(describe(value));
            return this;
        }

        /**
         * Adds a named argument.
         *
         * @param argName argument name
         * @param value argument value
         * @return this builder
         */
        public Builder namedArg(String argName, Object value) {
            Preconditions.checkNotNull(argName, "argName must not be null");
            namedArgs.put(argName, describe(value));
            return this;
        }

        public CallSite build() {
            return new CallSite(name, positionalArgs, namedArgs);
        }
    }
}
