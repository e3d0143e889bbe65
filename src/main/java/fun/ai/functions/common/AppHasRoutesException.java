package fun.ai.functions.common;

/**
 * 远端应用仍挂有路由，禁止删除（403）。
 */
public class AppHasRoutesException extends RuntimeException {
    private final int routeCount;

    public AppHasRoutesException(String appName, int routeCount) {
        super("Unable to delete app " + appName + " with routes");
        this.routeCount = routeCount;
    }

    public int getRouteCount() {
        return routeCount;
    }
}
