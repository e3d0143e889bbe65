package fun.ai.functions.common;

/**
 * 本地未登记该应用（404）。远端平台不会被调用。
 */
public class AppNotFoundException extends RuntimeException {
    public AppNotFoundException(String appName) {
        super("App " + appName + " not found");
    }
}
