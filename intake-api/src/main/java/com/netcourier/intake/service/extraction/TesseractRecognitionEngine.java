package com.netcourier.intake.service.extraction;

import com.netcourier.intake.config.IntakeProperties;
import com.netcourier.intake.service.intake.IntakeException;
import com.netcourier.intake.service.intake.IntakeFailure;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

@Component
public class TesseractRecognitionEngine implements TextRecognitionEngine {

    private final String language;
    private final String datapath;

    public TesseractRecognitionEngine(IntakeProperties properties) {
        this.language = properties.getOcr().getLanguage();
        this.datapath = properties.getOcr().getDatapath();
    }

    @Override
    public void recognize(Path image, Path outputBase) {
        try {
            newEngine().createDocuments(image.toString(), outputBase.toString(), List.of(ITesseract.RenderedFormat.TEXT));
        } catch (TesseractException | RuntimeException e) {
            throw new IntakeException(IntakeFailure.EXTERNAL_TOOL_FAILURE, "Tesseract failed on " + image.getFileName(), e);
        } catch (LinkageError e) {
            // native libtesseract missing or not loadable through JNA
            throw new IntakeException(IntakeFailure.EXTERNAL_TOOL_FAILURE, "Tesseract library is not available", e);
        }
    }

    // Tesseract instances are not thread-safe
    private ITesseract newEngine() {
        Tesseract engine = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            engine.setDatapath(datapath);
        }
        if (language != null && !language.isBlank()) {
            engine.setLanguage(language);
        }
        return engine;
    }
}
