package com.mimecast.mailhealth.endpoints;

import java.io.IOException;

/**
 * Status page renderer.
 */
@FunctionalInterface
public interface StatusRenderer {

    /**
     * Renders a snapshot into a page.
     *
     * @param snapshot StatusSnapshot instance.
     * @return Page HTML.
     * @throws IOException Unable to render.
     */
    String render(StatusSnapshot snapshot) throws IOException;
}
