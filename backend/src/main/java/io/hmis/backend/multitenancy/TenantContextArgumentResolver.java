package io.hmis.backend.multitenancy;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/** Hands the filter-bound {@link TenantContext} to controller methods as an explicit argument. */
@Component
public class TenantContextArgumentResolver implements HandlerMethodArgumentResolver {

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return TenantContext.class.equals(parameter.getParameterType());
  }

  @Override
  public TenantContext resolveArgument(
      MethodParameter parameter,
      ModelAndViewContainer mavContainer,
      NativeWebRequest webRequest,
      WebDataBinderFactory binderFactory) {
    Object bound =
        webRequest.getAttribute(TenantContext.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
    if (bound instanceof TenantContext context) {
      return context;
    }
    throw new IllegalStateException("Tenant context not bound: TenantFilter did not run");
  }
}
