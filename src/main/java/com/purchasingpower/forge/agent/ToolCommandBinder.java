package com.purchasingpower.forge.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.forge.exception.InvalidToolArgumentsException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds raw tool arguments to a typed command record and validates it.
 */
@Component
@RequiredArgsConstructor
public class ToolCommandBinder {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public <T> T bind(String toolName, Map<String, Object> parameters, Class<T> commandType) {
        T command;
        try {
            command = objectMapper.convertValue(parameters == null ? Map.of() : parameters, commandType);
        } catch (IllegalArgumentException e) {
            throw new InvalidToolArgumentsException(toolName, rootMessage(e));
        }

        Set<ConstraintViolation<T>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new InvalidToolArgumentsException(toolName, details);
        }
        return command;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null) {
            return root.getClass().getSimpleName();
        }
        int newline = message.indexOf('\n');
        return newline > 0 ? message.substring(0, newline) : message;
    }
}
