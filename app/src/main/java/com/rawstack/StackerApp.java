package com.rawstack;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;

import javax.swing.SwingUtilities;

public class StackerApp
{

	public static void main(String[] args)
	{
		if (args.length > 0)
		{
			System.exit(CommandLine.run(args));
		}
		FlatMacDarkLaf.setup();
		SwingUtilities.invokeLater(() -> {
			MainFrame frame = new MainFrame();
			frame.setVisible(true);
		});
	}
}
