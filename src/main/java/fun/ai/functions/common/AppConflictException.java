package fun.ai.functions.common;

/**
 * 同一项目下已存在同名应用（409）。
 */
public class AppConflictException extends RuntimeException {
    public AppConflictException(String appName) {
        super("App " + appName + " already exists");
    }

    public AppConflictException(String appName, Throwable cause) {
        super("App " + appName + " already exists", cause);
    }
}
