package com.example.mimimi.Handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /* 존재하지 않는 게임 */
    public static class GameNotFoundException extends RuntimeException {
        public GameNotFoundException(String message) {
            super(message);
        }
    }

    /* 게임 서버(타이머)가 떠 있지 않음 */
    public static class GameServerNotRunningException extends RuntimeException {
        public GameServerNotRunningException(String message) {
            super(message);
        }
    }

    /* 같은 라운드에 두 번째 선택 */
    public static class PickAlreadySubmittedException extends RuntimeException {
        public PickAlreadySubmittedException(String message) {
            super(message);
        }

        public PickAlreadySubmittedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /* 만료된 초대 코드 */
    public static class InviteExpiredException extends RuntimeException {
        public InviteExpiredException(String message) {
            super(message);
        }
    }

    // 존재하지 않는 게임 (404)
    @ExceptionHandler(GameNotFoundException.class)
    public ResponseEntity<String> handleGameNotFound(GameNotFoundException e) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(e.getMessage());
    }

    // 실행 중이 아닌 게임 서버 (404)
    @ExceptionHandler(GameServerNotRunningException.class)
    public ResponseEntity<String> handleNotRunning(GameServerNotRunningException e) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(e.getMessage());
    }

    // 만료된 초대 코드 (410)
    @ExceptionHandler(InviteExpiredException.class)
    public ResponseEntity<String> handleInviteExpired(InviteExpiredException e) {
        return ResponseEntity
                .status(HttpStatus.GONE)
                .body(e.getMessage());
    }

    // 중복 선택 (409)
    @ExceptionHandler(PickAlreadySubmittedException.class)
    public ResponseEntity<String> handlePickAlreadySubmitted(PickAlreadySubmittedException e) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(e.getMessage());
    }

    // 지금 상태에서 할 수 없는 전이 (409)
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<String> handleIllegalState(IllegalStateException e) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(e.getMessage());
    }

    // 그 외 잘못된 요청 (400)
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(e.getMessage());
    }

    // 서버 내부 오류 (500)
    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleException(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body("서버 내부 오류가 발생했습니다.");
    }
}
