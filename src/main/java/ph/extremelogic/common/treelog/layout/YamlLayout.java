package ph.extremelogic.common.treelog.layout;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.Map;

/**
 * One flow-style YAML mapping per record, so each record stays on a single line.
 */
public final class YamlLayout extends StructuredLayout {
    // Yaml instances are not thread-safe
    private static final ThreadLocal<Yaml> YAML = ThreadLocal.withInitial(() -> {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.FLOW);
        options.setWidth(Integer.MAX_VALUE);
        options.setSplitLines(false);
        return new Yaml(options);
    });

    @Override
    protected String render(Map<String, Object> fields) {
        return YAML.get().dump(fields).trim();
    }

    @Override
    public String getContentType() {
        return "application/yaml";
    }
}
