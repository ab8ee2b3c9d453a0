package me.internalizable.cricketscore.controller;

import me.internalizable.cricketscore.dto.HitRequest;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.RequestBodyAdviceAdapter;

import java.lang.reflect.Type;

/**
 * {@code /hit} takes its body as optional so that a JSON {@code null} reaches validation
 * as an empty submission. A request with no body at all is still unreadable.
 */
@ControllerAdvice
public class HitRequestBodyAdvice extends RequestBodyAdviceAdapter {

    @Override
    public boolean supports(MethodParameter methodParameter, Type targetType,
                            Class<? extends HttpMessageConverter<?>> converterType) {
        return HitRequest.class.equals(targetType);
    }

    @Override
    public Object handleEmptyBody(Object body, HttpInputMessage inputMessage, MethodParameter parameter,
                                  Type targetType, Class<? extends HttpMessageConverter<?>> converterType) {
        throw new HttpMessageNotReadableException("Required request body is missing", inputMessage);
    }
}
