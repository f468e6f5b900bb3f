package com.canihazhouze.agent.core;

import com.canihazhouze.agent.exception.ConfigurationException;
import com.canihazhouze.agent.model.AgentInputVariable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders an agent's prompt template by substituting {{name}} placeholders.
 *
 * A placeholder resolves to the supplied input value if there is one, and to
 * an empty string if the variable is declared but was not supplied. Anything
 * else is a broken template: a placeholder that is neither declared nor
 * supplied, an empty placeholder, or a "{{" without its closing "}}".
 */
@Component
public class PromptRenderer {

    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    public String render(String template,
                         List<AgentInputVariable> declared,
                         Map<String, String> values) {
        if (template == null) {
            throw new ConfigurationException("Agent has no prompt template");
        }

        StringBuilder out = new StringBuilder(template.length());
        int pos = 0;
        while (pos < template.length()) {
            int start = template.indexOf(OPEN, pos);
            if (start < 0) {
                out.append(template, pos, template.length());
                break;
            }
            int end = template.indexOf(CLOSE, start + OPEN.length());
            if (end < 0) {
                throw new ConfigurationException("Unclosed placeholder at position " + start + " of the prompt template");
            }

            String name = template.substring(start + OPEN.length(), end).trim();
            if (name.isEmpty()) {
                throw new ConfigurationException("Empty placeholder at position " + start + " of the prompt template");
            }

            out.append(template, pos, start);
            out.append(resolve(name, declared, values));
            pos = end + CLOSE.length();
        }
        return out.toString();
    }

    private String resolve(String name, List<AgentInputVariable> declared, Map<String, String> values) {
        if (values != null && values.containsKey(name)) {
            String value = values.get(name);
            return value != null ? value : "";
        }
        boolean isDeclared = declared != null
                && declared.stream().anyMatch(v -> name.equals(v.getName()));
        if (isDeclared) {
            return "";
        }
        throw new ConfigurationException("Placeholder {{" + name + "}} is neither declared nor supplied");
    }
}
