package testlab.master.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import testlab.master.api.Controller;
import testlab.master.api.v1.dto.DeviceRequest;
import testlab.master.api.v1.dto.DeviceResponse;
import testlab.master.api.v1.dto.HealthReportRequest;
import testlab.master.model.Device;
import testlab.master.server.RouterHandler;
import testlab.master.service.DeviceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the device registry (public API).
 *
 * GET /api/v1/devices - All devices
 * GET /api/v1/devices/{hostname} - One device
 * POST /api/v1/devices - Register a device
 * POST /api/v1/devices/{hostname}/health - Report a health probe result
 * POST /api/v1/devices/{hostname}/maintenance|online|retire - Admin state changes
 * GET /api/v1/device-types - Idle/busy/offline counts per device type
 */
public class DeviceController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DeviceController.class);

    private static final Pattern DEVICES_PATTERN = Pattern.compile("^/api/v1/devices$");
    private static final Pattern DEVICE_PATTERN = Pattern.compile("^/api/v1/devices/([^/]+)$");
    private static final Pattern DEVICE_ACTION_PATTERN =
            Pattern.compile("^/api/v1/devices/([^/]+)/(health|maintenance|online|retire)$");
    private static final String DEVICE_TYPES_PATH = "/api/v1/device-types";

    private final DeviceRegistry registry;

    public DeviceController(DeviceRegistry registry) {
        this.registry = registry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return DEVICES_PATTERN.matcher(path).matches()
                    || DEVICE_PATTERN.matcher(path).matches()
                    || DEVICE_TYPES_PATH.equals(path);
        }
        if (method.equals(HttpMethod.POST)) {
            return DEVICES_PATTERN.matcher(path).matches() || DEVICE_ACTION_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (DEVICE_TYPES_PATH.equals(path)) {
            return ControllerResponse.json(RouterHandler.toJson(registry.typeSummary()));
        }
        if (DEVICES_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST) ? handleRegister(req) : handleList();
        }

        Matcher action = DEVICE_ACTION_PATTERN.matcher(path);
        if (action.matches()) {
            return handleAction(req, action.group(1), action.group(2));
        }

        Matcher device = DEVICE_PATTERN.matcher(path);
        if (device.matches()) {
            String hostname = device.group(1);
            return registry.find(hostname)
                    .map(d -> ControllerResponse.json(RouterHandler.toJson(DeviceResponse.from(d))))
                    .orElseGet(() -> ControllerResponse.notFound("device not found: " + hostname));
        }

        return ControllerResponse.notFound("unknown device endpoint");
    }

    private ControllerResponse handleList() {
        List<DeviceResponse> devices = registry.findAll().stream().map(DeviceResponse::from).toList();
        return ControllerResponse.json(RouterHandler.toJson(devices));
    }

    private ControllerResponse handleRegister(FullHttpRequest req) {
        DeviceRequest request = RouterHandler.readBody(req, DeviceRequest.class);
        Device device = registry.register(request.hostname(), request.deviceType(), request.tags());
        return ControllerResponse.json(HttpResponseStatus.CREATED, RouterHandler.toJson(DeviceResponse.from(device)));
    }

    private ControllerResponse handleAction(FullHttpRequest req, String hostname, String action) {
        Device updated = switch (action) {
            case "health" -> {
                HealthReportRequest report = RouterHandler.readBody(req, HealthReportRequest.class);
                report.validate();
                yield registry.reportHealth(hostname, report.result());
            }
            case "maintenance" -> registry.putIntoMaintenance(hostname);
            case "online" -> registry.putOnline(hostname);
            case "retire" -> registry.retire(hostname);
            default -> throw new IllegalArgumentException("unknown action: " + action);
        };
        log.debug("Device {} {} -> {}/{}", hostname, action, updated.status(), updated.health());
        return ControllerResponse.json(RouterHandler.toJson(DeviceResponse.from(updated)));
    }
}
