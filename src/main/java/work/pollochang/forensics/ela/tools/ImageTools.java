package work.pollochang.forensics.ela.tools;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

public final class ImageTools {

    private ImageTools() {}

    /**
     * 轉為 {@link BufferedImage#TYPE_INT_RGB}。已是該型別時直接回傳原物件，
     * 其他型別重新繪製，透明區域會與黑色背景合成。
     */
    public static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = rgb.createGraphics();
        try {
            g2d.drawImage(image, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return rgb;
    }

    /**
     * 以指定品質將圖片編碼成 JPEG 寫入輸出串流。
     *
     * <p>每次呼叫都使用新的 {@link ImageWriter}，固定為基線 (非漸進式) 編碼，
     * 其餘沿用寫入器預設值 (包含 4:2:0 色度取樣)，確保相同輸入得到相同輸出。</p>
     *
     * @param image   要編碼的圖片
     * @param os      輸出串流
     * @param quality 壓縮品質，0.0f (最低) 到 1.0f (最高)
     * @throws IOException 找不到 JPEG 寫入器或寫入失敗
     */
    public static void writeJpeg(BufferedImage image, OutputStream os, float quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("找不到 JPEG 寫入器");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(os)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            param.setProgressiveMode(ImageWriteParam.MODE_DISABLED);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
