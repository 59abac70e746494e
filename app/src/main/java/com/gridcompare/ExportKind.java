package com.gridcompare;

public enum ExportKind
{
	PNG("Exporting PNG..."),
	HTML("Exporting HTML...");

	private final String startMessage;

	ExportKind(String startMessage)
	{
		this.startMessage = startMessage;
	}

	String startMessage()
	{
		return startMessage;
	}
}
