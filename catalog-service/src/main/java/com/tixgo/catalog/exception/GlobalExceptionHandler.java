package com.tixgo.catalog.exception;

import com.tixgo.common.exception.MarketplaceExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler extends MarketplaceExceptionHandler {

    public GlobalExceptionHandler() {
        super("catalog");
    }
}
