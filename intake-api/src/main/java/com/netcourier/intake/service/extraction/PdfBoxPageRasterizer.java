package com.netcourier.intake.service.extraction;

import com.netcourier.intake.config.IntakeProperties;
import com.netcourier.intake.service.intake.IntakeException;
import com.netcourier.intake.service.intake.IntakeFailure;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class PdfBoxPageRasterizer implements PageRasterizer {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxPageRasterizer.class);

    private final int dpi;

    public PdfBoxPageRasterizer(IntakeProperties properties) {
        this.dpi = Math.max(72, properties.getOcr().getDpi());
    }

    @Override
    public List<Path> rasterize(Path document, Path targetDirectory) {
        try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
            PDFRenderer renderer = new PDFRenderer(pdf);
            List<Path> pages = new ArrayList<>();
            for (int index = 0; index < pdf.getNumberOfPages(); index++) {
                BufferedImage image = renderer.renderImageWithDPI(index, dpi, ImageType.GRAY);
                Path page = targetDirectory.resolve(String.format("page-%04d.png", index + 1));
                ImageIO.write(image, "png", page.toFile());
                pages.add(page);
            }
            log.debug("Rasterized {} pages of {} at {} dpi", pages.size(), document.getFileName(), dpi);
            return pages;
        } catch (IOException e) {
            throw new IntakeException(IntakeFailure.EXTERNAL_TOOL_FAILURE, "Failed to rasterize " + document.getFileName(), e);
        }
    }
}
