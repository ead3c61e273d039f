package com.example.slides.export;

import com.example.slides.config.SlideExtractionProperties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds a PDF with one slide per page. Landscape slides get a landscape A4
 * page, portrait slides a portrait one; each image is scaled to fit inside the
 * margin and centred.
 */
@Service
public class PdfSlideExporter {

    private static final Logger log = LoggerFactory.getLogger(PdfSlideExporter.class);

    static final PDRectangle A4_LANDSCAPE = new PDRectangle(PDRectangle.A4.getHeight(), PDRectangle.A4.getWidth());

    private final float margin;

    @Autowired
    public PdfSlideExporter(SlideExtractionProperties properties) {
        this(properties.getExport().getPdfMargin());
    }

    PdfSlideExporter(float margin) {
        this.margin = margin;
    }

    /**
     * @param images Slide images in page order
     * @param pdfPath Destination file, parent directories are created
     * @throws IllegalArgumentException if no images are given
     * @throws SlideExportException if an image cannot be read or the PDF cannot be written
     */
    public Path export(List<Path> images, Path pdfPath) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("No images selected.");
        }
        log.info("Building PDF: {} slides -> {}", images.size(), pdfPath);

        try (PDDocument document = new PDDocument()) {
            for (Path image : images) {
                addPage(document, image);
            }
            Path parent = pdfPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            document.save(pdfPath.toFile());
        } catch (IOException | IllegalArgumentException e) {
            // PDFBox reports unrecognised image content as IllegalArgumentException
            throw new SlideExportException("Failed to build PDF " + pdfPath + ": " + e.getMessage(), e);
        }

        log.info("PDF saved successfully");
        return pdfPath;
    }

    private void addPage(PDDocument document, Path image) throws IOException {
        PDImageXObject pdImage = PDImageXObject.createFromFileByContent(image.toFile(), document);
        float imageWidth = pdImage.getWidth();
        float imageHeight = pdImage.getHeight();

        PDRectangle pageSize = imageWidth >= imageHeight ? A4_LANDSCAPE : PDRectangle.A4;
        PDPage page = new PDPage(pageSize);
        document.addPage(page);

        float pageWidth = pageSize.getWidth();
        float pageHeight = pageSize.getHeight();
        float scale = Math.min((pageWidth - 2 * margin) / imageWidth, (pageHeight - 2 * margin) / imageHeight);
        float drawWidth = imageWidth * scale;
        float drawHeight = imageHeight * scale;

        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.drawImage(pdImage, (pageWidth - drawWidth) / 2, (pageHeight - drawHeight) / 2, drawWidth, drawHeight);
        }
    }
}
