package fun.fengwk.discovery.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes rendered tool text through as is, instead of serializing it as a JSON string.
 *
 * @author fengwk
 */
public class TextToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalStateException("tool must return text, got " + result.getClass().getName());
    }

}
