package com.xinyue.margin.web;

import org.noear.solon.Solon;

/**
 * Solon Web 服务器启动类。账本组件由 {@link com.xinyue.margin.web.context.AppContext} 装配。
 */
public class WebApp {

    public static void main(String[] args) {
        Solon.start(WebApp.class, args);
    }
}
