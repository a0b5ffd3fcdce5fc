package me.christianrobert.convertifier.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.convertifier.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * REST access to the translator settings held by {@link ConfigService}.
 * Unknown keys and unusable values are answered with 400.
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting translator configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return badRequest("Request body must contain at least one configuration entry");
        }
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);
            return success("Configuration saved successfully");
        } catch (IllegalArgumentException e) {
            log.warn("Rejected configuration update: {}", e.getMessage());
            return badRequest(e.getMessage());
        }
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return badRequest("Request body must contain 'value' field");
        }

        Object value = body.get("value");
        try {
            configService.setConfigValue(key, value);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected config value for {}: {}", key, e.getMessage());
            return badRequest(e.getMessage());
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration value updated successfully");
        response.put("key", key);
        response.put("value", value);

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");
        configService.resetToDefaults();
        return success("Configuration reset to defaults successfully");
    }

    private static Response success(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", message);
        return Response.ok(response).build();
    }

    private static Response badRequest(String message) {
        Map<String, String> errorResponse = new HashMap<>();
        errorResponse.put("status", "error");
        errorResponse.put("message", message);
        return Response.status(Response.Status.BAD_REQUEST)
                .entity(errorResponse)
                .build();
    }
}
