package io.mylab.lab.labplatform.access;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Rejects the request when access came through a grant that does not allow re-sharing. Must be
 * combined with {@link RequireObjectAccess}; owners pass.
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RequireResharePermission {}
