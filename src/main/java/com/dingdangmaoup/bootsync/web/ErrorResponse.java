package com.dingdangmaoup.bootsync.web;

import lombok.Value;

@Value
public class ErrorResponse {
    String error;
    String message;
}
