package com.codeops.qr.service;

import com.codeops.qr.config.AppConstants;
import com.codeops.qr.exception.RenderFailureException;
import com.codeops.qr.model.QrRequest;
import com.codeops.qr.model.enums.ErrorCorrection;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;

/**
 * ZXing-backed renderer producing PNG, JPEG, SVG, and PDF documents.
 *
 * <p>Raster output is always exactly the requested edge length in pixels, with each module
 * drawn at a whole number of pixels; a symbol too dense for the size is refused. SVG output
 * uses one unit per module in its view box and is scaled by the viewer. PDF output
 * centres the raster image on a US Letter page.</p>
 */
@Component
@Slf4j
public class ZxingQrRenderer implements QrRenderer {

    private final QRCodeWriter writer = new QRCodeWriter();

    @Override
    public byte[] render(QrRequest request) {
        try {
            return switch (request.format()) {
                case PNG -> writePng(rasterize(request));
                case JPEG -> writeJpeg(rasterize(request));
                case SVG -> writeSvg(encode(request, 0), request.size().pixels());
                case PDF -> writePdf(rasterize(request), request.size().pixels());
            };
        } catch (WriterException e) {
            throw RenderFailureException.callerCaused("Failed to generate QR code: " + e.getMessage(), e);
        } catch (IOException e) {
            throw RenderFailureException.unexpected("Failed to write " + request.format().value() + " output", e);
        }
    }

    private BitMatrix encode(QrRequest request, int pixels) throws WriterException {
        Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
        hints.put(EncodeHintType.ERROR_CORRECTION, toZxingLevel(request.errorCorrection()));
        hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        hints.put(EncodeHintType.MARGIN, AppConstants.QR_MARGIN_MODULES);
        return writer.encode(request.data(), BarcodeFormat.QR_CODE, pixels, pixels, hints);
    }

    /**
     * Renders an RGB image of exactly the requested size. Every module is drawn as the same
     * whole number of pixels and the remainder is white padding around the quiet zone.
     *
     * @throws RenderFailureException if the symbol needs more modules than the size can
     *                                draw at {@link AppConstants#MIN_PIXELS_PER_MODULE}
     */
    private BufferedImage rasterize(QrRequest request) throws WriterException {
        int pixels = request.size().pixels();
        BitMatrix matrix = encode(request, 0);
        int modules = matrix.getWidth();
        int scale = pixels / modules;
        if (scale < AppConstants.MIN_PIXELS_PER_MODULE) {
            throw RenderFailureException.callerCaused(String.format(
                    "Data too dense for size %s: %d modules need at least %dpx, use a larger size",
                    request.size().value(), modules, modules * AppConstants.MIN_PIXELS_PER_MODULE), null);
        }

        BufferedImage source = MatrixToImageWriter.toBufferedImage(matrix);
        int edge = modules * scale;
        int offset = (pixels - edge) / 2;

        BufferedImage target = new BufferedImage(pixels, pixels, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
                    RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, pixels, pixels);
            graphics.drawImage(source, offset, offset, edge, edge, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    private static byte[] writePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG image writer available");
        }
        return out.toByteArray();
    }

    private static byte[] writeJpeg(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG image writer available");
        }
        ImageWriter jpegWriter = writers.next();
        ImageWriteParam param = jpegWriter.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(AppConstants.JPEG_QUALITY);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            jpegWriter.setOutput(ios);
            jpegWriter.write(null, new IIOImage(image, null, null), param);
        } finally {
            jpegWriter.dispose();
        }
        return out.toByteArray();
    }

    static byte[] writeSvg(BitMatrix matrix, int pixels) {
        int width = matrix.getWidth();
        int height = matrix.getHeight();
        StringBuilder svg = new StringBuilder(1024);
        svg.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<svg xmlns=\"http://www.w3.org/2000/svg\" version=\"1.1\"")
                .append(" width=\"").append(pixels).append("\" height=\"").append(pixels).append('"')
                .append(" viewBox=\"0 0 ").append(width).append(' ').append(height).append('"')
                .append(" shape-rendering=\"crispEdges\">\n")
                .append("<rect width=\"100%\" height=\"100%\" fill=\"white\"/>\n");

        // one rect per horizontal run of dark modules
        for (int y = 0; y < height; y++) {
            int x = 0;
            while (x < width) {
                if (!matrix.get(x, y)) {
                    x++;
                    continue;
                }
                int start = x;
                while (x < width && matrix.get(x, y)) {
                    x++;
                }
                svg.append("<rect x=\"").append(start).append("\" y=\"").append(y)
                        .append("\" width=\"").append(x - start).append("\" height=\"1\" fill=\"black\"/>\n");
            }
        }
        svg.append("</svg>\n");
        return svg.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] writePdf(BufferedImage image, int pixels) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);

            PDImageXObject pdImage = LosslessFactory.createFromImage(document, image);
            float x = (page.getMediaBox().getWidth() - pixels) / 2f;
            float y = (page.getMediaBox().getHeight() - pixels) / 2f;
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.drawImage(pdImage, x, y, pixels, pixels);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }

    private static ErrorCorrectionLevel toZxingLevel(ErrorCorrection level) {
        return switch (level) {
            case L -> ErrorCorrectionLevel.L;
            case M -> ErrorCorrectionLevel.M;
            case Q -> ErrorCorrectionLevel.Q;
            case H -> ErrorCorrectionLevel.H;
        };
    }
}
