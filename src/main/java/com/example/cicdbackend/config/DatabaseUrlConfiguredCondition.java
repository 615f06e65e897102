package com.example.cicdbackend.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

/**
 * Matches when {@code cicd-backend.database-url} holds a non-blank value.
 * The value is read as plain text, so any character in a password is safe.
 */
class DatabaseUrlConfiguredCondition implements Condition {

    static final String PROPERTY = "cicd-backend.database-url";

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return StringUtils.hasText(context.getEnvironment().getProperty(PROPERTY));
    }
}
