package com.mygraph.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.File;
import java.nio.file.Paths;

/**
 * 读取 .env 文件；没有 .env 时退回系统环境变量
 */
@Configuration
public class EnvConfig {
    public static final String BEAN_NAME = "envConfig";
    private static final Logger logger = LoggerFactory.getLogger(EnvConfig.class);
    private static volatile Dotenv dotenv;

    @PostConstruct
    public void loadEnv() {
        dotenv = load();
    }

    static Dotenv load() {
        try {
            // 依次查找当前目录、工作目录、上级目录
            String[] possiblePaths = {
                ".env",
                Paths.get(System.getProperty("user.dir"), ".env").toString(),
                Paths.get(System.getProperty("user.dir"), "..", ".env").toString()
            };

            for (String path : possiblePaths) {
                File file = new File(path);
                if (file.exists() && file.isFile()) {
                    String envDir = file.getAbsoluteFile().getParent();
                    logger.info("Loading .env file from directory: {}", envDir);
                    return Dotenv.configure()
                        .directory(envDir)
                        .filename(".env")
                        .ignoreIfMissing()
                        .load();
                }
            }
            logger.debug(".env file not found. Using system environment variables or default values.");
            return Dotenv.configure().ignoreIfMissing().load();
        } catch (Exception e) {
            logger.error("Failed to load .env file", e);
            return Dotenv.configure().ignoreIfMissing().load();
        }
    }

    /**
     * 未通过 Spring 初始化时（例如 ConnectionAdapter.shared()）按需加载
     */
    private static Dotenv dotenv() {
        Dotenv current = dotenv;
        if (current == null) {
            synchronized (EnvConfig.class) {
                current = dotenv;
                if (current == null) {
                    current = load();
                    dotenv = current;
                }
            }
        }
        return current;
    }

    public static String get(String key) {
        return dotenv().get(key);
    }

    public static String get(String key, String defaultValue) {
        String value = dotenv().get(key);
        return value != null && !value.isEmpty() ? value : defaultValue;
    }
}
