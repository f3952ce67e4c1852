package com.project.recall.backend.utils;

import com.project.recall.backend.exception.ExceptionMessage;
import com.project.recall.backend.exception.ValidationFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.BindingResult;
import org.springframework.validation.Validator;

/**
 * Runs bean validation on objects that do not arrive through a controller, such as cards
 * captured by the bot.
 */
@Slf4j
@Component
public class EntityValidator {
    private final Validator validator;

    EntityValidator(Validator validator) {
        this.validator = validator;
    }

    public void validate(Object target) {
        String name = target.getClass().getSimpleName();
        BindingResult bindingResult = new BeanPropertyBindingResult(target, name);
        validator.validate(target, bindingResult);
        if (bindingResult.hasErrors()) {
            log.debug("{} rejected: {}", name, ValidationFailureException.fieldMessages(bindingResult));
            throw new ValidationFailureException(ExceptionMessage.VALIDATION_FAILED, bindingResult);
        }
    }
}
