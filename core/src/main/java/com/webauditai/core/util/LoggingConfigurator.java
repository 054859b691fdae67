package com.webauditai.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * JUL 루트 핸들러 구성. slf4j-jdk14 바인딩이 SLF4J 출력을 여기로 보낸다.
 * 콘솔 + 롤링 파일(audit-%g.log), 메시지 한 줄 포맷.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);

        Formatter lineFormat = new Formatter() {
            @Override public String format(LogRecord r) {
                String msg = formatMessage(r);
                if (r.getThrown() != null) msg = msg + " | " + r.getThrown();
                return msg + System.lineSeparator();
            }
        };

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(lineFormat);
        root.addHandler(console);

        try {
            Files.createDirectories(logDir);
            String pattern = logDir.resolve("audit-%g.log").toString();
            FileHandler file = new FileHandler(pattern, maxBytes, fileCount, true);
            file.setLevel(rootLevel);
            file.setFormatter(lineFormat);
            root.addHandler(file);
        } catch (IOException e) {
            // 파일 로그 실패 시 콘솔만으로 계속
            System.err.println("Failed to init file handler: " + e.getMessage());
        }

        root.setLevel(rootLevel);
    }
}
