package com.chicu.botjobs.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ApiResponse {
    private String status;
    private String message;
    private Integer affected;

    public static ApiResponse ok(String msg, int affected) {
        return new ApiResponse("ok", msg, affected);
    }
}
