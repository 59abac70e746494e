package com.gridcompare;

@FunctionalInterface
public interface ProgressListener
{
	void onProgress(int current, int total);
}
