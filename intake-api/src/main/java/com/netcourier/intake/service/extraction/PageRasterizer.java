package com.netcourier.intake.service.extraction;

import java.nio.file.Path;
import java.util.List;

/**
 * Renders a paginated document into one image per page.
 */
public interface PageRasterizer {

    /**
     * @return page images inside {@code targetDirectory}, in page order; their file names sort
     * lexicographically in the same order
     */
    List<Path> rasterize(Path document, Path targetDirectory);
}
