package ph.extremelogic.common.treelog.filter;

import ph.extremelogic.common.treelog.ConfigurationException;
import ph.extremelogic.common.treelog.LogRecord;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Admits records whose message contains a match of the pattern, or, when inverted,
 * records whose message contains none.
 */
public final class RegexFilter implements Filter {
    private final Pattern pattern;
    private final boolean invert;

    public RegexFilter(String regex) {
        this(regex, false);
    }

    public RegexFilter(String regex, boolean invert) {
        if (regex == null) {
            throw new ConfigurationException("Regex filter requires a pattern");
        }
        try {
            this.pattern = Pattern.compile(regex, Pattern.MULTILINE | Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid regex filter pattern: " + regex, e);
        }
        this.invert = invert;
    }

    @Override
    public boolean admit(LogRecord record) {
        boolean found = pattern.matcher(record.getMessage()).find();
        return invert != found;
    }

    public String getPattern() {
        return pattern.pattern();
    }

    public boolean isInvert() {
        return invert;
    }
}
