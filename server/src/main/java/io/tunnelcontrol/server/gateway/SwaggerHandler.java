package io.tunnelcontrol.server.gateway;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * {@code GET /swagger}: a Swagger UI page with the OpenAPI document of this API inlined. UI assets
 * come from the public {@code swagger-ui-dist} CDN; the document itself is the classpath resource
 * {@value #OPENAPI_RESOURCE}.
 */
public final class SwaggerHandler implements Handler {

    static final String OPENAPI_RESOURCE = "/openapi.json";
    static final String SWAGGER_UI_BASE = "https://unpkg.com/swagger-ui-dist@5";

    private final String page;

    public SwaggerHandler() {
        this.page = render(loadOpenApiDocument());
    }

    @Override
    public void handle(Context ctx) {
        ctx.status(200);
        ctx.html(page);
    }

    /** The raw OpenAPI document. */
    static String loadOpenApiDocument() {
        try (InputStream in = SwaggerHandler.class.getResourceAsStream(OPENAPI_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + OPENAPI_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + OPENAPI_RESOURCE, e);
        }
    }

    private static String render(String openApiJson) {
        // The document is JSON, which is a valid JavaScript expression; only "</" needs escaping in a script block.
        String inlined = openApiJson.replace("</", "<\\/");
        return "<!DOCTYPE html>\n"
                + "<html lang=\"en\">\n"
                + "<head>\n"
                + "  <meta charset=\"UTF-8\">\n"
                + "  <meta name=\"viewport\" content=\"width=device-width, initial-scale=1\">\n"
                + "  <title>Tunnel Control API</title>\n"
                + "  <link rel=\"stylesheet\" href=\"" + SWAGGER_UI_BASE + "/swagger-ui.css\">\n"
                + "</head>\n"
                + "<body>\n"
                + "  <div id=\"swagger-ui\"></div>\n"
                + "  <script src=\"" + SWAGGER_UI_BASE + "/swagger-ui-bundle.js\"></script>\n"
                + "  <script>\n"
                + "    SwaggerUIBundle({\n"
                + "      spec: " + inlined + ",\n"
                + "      dom_id: '#swagger-ui',\n"
                + "      deepLinking: true,\n"
                + "      presets: [SwaggerUIBundle.presets.apis, SwaggerUIBundle.SwaggerUIStandalonePreset],\n"
                + "      layout: 'BaseLayout'\n"
                + "    });\n"
                + "  </script>\n"
                + "</body>\n"
                + "</html>\n";
    }
}
