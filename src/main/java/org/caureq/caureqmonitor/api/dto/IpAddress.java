package org.caureq.caureqmonitor.api.dto;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.*;

/** Null or blank passes; anything else must be a literal address of the given family. */
@Documented
@Constraint(validatedBy = IpAddressValidator.class)
@Target({ElementType.METHOD, ElementType.FIELD, ElementType.ANNOTATION_TYPE, ElementType.PARAMETER, ElementType.TYPE_USE})
@Retention(RetentionPolicy.RUNTIME)
public @interface IpAddress {
    Family value();

    String message() default "must be a valid {value} address";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};

    enum Family { IPV4, IPV6 }
}
