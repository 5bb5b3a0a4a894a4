package io.mylab.lab.labplatform.access;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Guards a handler with the ownership/grant policy. The object id is read from the URI variable or
 * request parameter named {@link #idParam()}.
 *
 * <pre>{@code
 * @PutMapping("/api/samples/{id}")
 * @RequireObjectAccess(value = "sample", minimumRole = "processor")
 * public ResponseEntity<?> update(@PathVariable UUID id, ...)
 * }</pre>
 *
 * @see ObjectAccessInterceptor
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireObjectAccess {

  /** Resource type. Empty reads it from the {@link #typeParam()} URI variable. */
  String value() default "";

  /** Minimum grant role for access through a grant; empty means any active grant. */
  String minimumRole() default "";

  String idParam() default "id";

  String typeParam() default "objectType";
}
