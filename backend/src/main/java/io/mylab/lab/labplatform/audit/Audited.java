package io.mylab.lab.labplatform.audit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Records an audit entry after a handler completes successfully. The write happens after the
 * response has been produced and cannot change it.
 *
 * @see AuditInterceptor
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Audited {

  AuditAction action();

  /** Object type. Empty reads it from the {@link #typeParam()} URI variable. */
  String objectType() default "";

  String idParam() default "id";

  String typeParam() default "objectType";
}
