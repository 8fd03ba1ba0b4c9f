package com.rawstack;

import javax.swing.JPanel;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Shows the latest stacking preview scaled to fit, aspect ratio preserved.
 */
class PreviewPanel extends JPanel
{
	private BufferedImage image;

	PreviewPanel()
	{
		setPreferredSize(new Dimension(640, 480));
		setBackground(new Color(42, 42, 42));
	}

	void setImage(BufferedImage img)
	{
		this.image = img;
		repaint();
	}

	@Override
	protected void paintComponent(Graphics g)
	{
		super.paintComponent(g);
		if (image == null)
		{
			g.setColor(Color.GRAY);
			String msg = "No preview yet";
			int sw = g.getFontMetrics().stringWidth(msg);
			g.drawString(msg, (getWidth() - sw) / 2, getHeight() / 2);
			return;
		}

		Insets insets = getInsets();
		int areaW = getWidth() - insets.left - insets.right;
		int areaH = getHeight() - insets.top - insets.bottom;
		if (areaW <= 0 || areaH <= 0) return;

		int imgW = image.getWidth();
		int imgH = image.getHeight();
		double scale = Math.min((double) areaW / imgW, (double) areaH / imgH);

		int drawW = (int) (imgW * scale);
		int drawH = (int) (imgH * scale);
		int drawX = insets.left + (areaW - drawW) / 2;
		int drawY = insets.top + (areaH - drawH) / 2;

		Graphics2D g2 = (Graphics2D) g;
		g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION,
				RenderingHints.VALUE_INTERPOLATION_BILINEAR);
		g2.drawImage(image, drawX, drawY, drawW, drawH, null);
	}
}
