package com.bootstrap.shared.exception;

import lombok.Getter;

/**
 * 必要設定缺漏（例如 PROJECT_ID、STRIPE_SECRET_KEY）
 *
 * 一定在任何 provider 修改之前拋出，CLI 對應 exit 2。
 */
@Getter
public class MissingConfigurationException extends RuntimeException {

    private final String setting;

    public MissingConfigurationException(String setting, String message) {
        super(message);
        this.setting = setting;
    }
}
