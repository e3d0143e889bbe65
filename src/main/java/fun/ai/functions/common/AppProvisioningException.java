package fun.ai.functions.common;

/**
 * 创建应用时远端开通或本地登记失败。不透传平台状态码，统一按 500 返回。
 */
public class AppProvisioningException extends RuntimeException {
    public AppProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
