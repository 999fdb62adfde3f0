package com.faceattendance.config;

import com.faceattendance.streaming.AttendanceWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final AttendanceWebSocketHandler attendanceHandler;

    public WebSocketConfig(AttendanceWebSocketHandler attendanceHandler) {
        this.attendanceHandler = attendanceHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(attendanceHandler, "/ws/attendance")
                .setAllowedOrigins("*"); // Allow frontend access
    }
}
