package io.mylab.lab.labplatform.config;

import io.mylab.lab.labplatform.access.ObjectAccessInterceptor;
import io.mylab.lab.labplatform.audit.AuditInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Access checks run before audit so a denied request never produces an audit entry. */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  private final ObjectAccessInterceptor objectAccessInterceptor;
  private final AuditInterceptor auditInterceptor;

  public WebMvcConfig(
      ObjectAccessInterceptor objectAccessInterceptor, AuditInterceptor auditInterceptor) {
    this.objectAccessInterceptor = objectAccessInterceptor;
    this.auditInterceptor = auditInterceptor;
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(objectAccessInterceptor).addPathPatterns("/api/**");
    registry.addInterceptor(auditInterceptor).addPathPatterns("/api/**");
  }
}
