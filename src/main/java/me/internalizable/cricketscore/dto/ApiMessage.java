package me.internalizable.cricketscore.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiMessage(String message, String error) {

    public static ApiMessage success(String message) {
        return new ApiMessage(message, null);
    }

    public static ApiMessage error(String error) {
        return new ApiMessage(null, error);
    }
}
