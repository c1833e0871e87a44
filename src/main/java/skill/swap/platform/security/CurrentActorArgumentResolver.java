package skill.swap.platform.security;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;
import skill.swap.platform.exception.InvalidCredentialsException;

/**
 * Resolves {@link CurrentActor} parameters from the attribute set by {@link AuthenticationInterceptor}
 */
@Component
public class CurrentActorArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentActor.class)
                && Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object actor = webRequest.getAttribute(AuthenticationInterceptor.ACTOR_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST);
        if (actor == null) {
            throw new InvalidCredentialsException("Authentication required");
        }
        return actor;
    }
}
