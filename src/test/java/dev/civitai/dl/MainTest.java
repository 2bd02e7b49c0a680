package dev.civitai.dl;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class MainTest {

	@Test
	void testSubcommandsRegistered() {
		// Given
		CommandLine commandLine = new CommandLine(new Main());

		// When/Then
		assertThat(commandLine.getSubcommands()).containsOnlyKeys("download", "images", "model");
	}

	@Test
	void testImagesParams() {
		// Given
		ImagesCommand command = new ImagesCommand();

		// When
		new CommandLine(command).parseArgs("--model-id", "12", "--username", "alice", "--limit", "50");
		Map<String, String> params = command.params();

		// Then
		assertThat(params).containsExactly(
				Map.entry("modelId", "12"), Map.entry("username", "alice"), Map.entry("limit", "50"));
	}

	@Test
	void testImagesWithoutFilterFails() {
		// Given
		CommandLine commandLine = new CommandLine(new Main());

		// When
		int exitCode = commandLine.execute("images");

		// Then
		assertThat(exitCode).isEqualTo(1);
	}

	@Test
	void testDownloadWithoutTargetsFails() {
		assertThat(new CommandLine(new Main()).execute("download")).isEqualTo(1);
	}

	@Test
	void testDownloadOptionsParse() {
		// Given
		DownloadCommand command = new DownloadCommand();

		// When
		CommandLine.ParseResult result = new CommandLine(command)
				.parseArgs("-i", "1,2", "--threads", "4", "-p", "2", "https://files.test/a.bin");

		// Then
		assertThat(result.<List<Long>>matchedOptionValue("--version-id", null)).containsExactly(1L, 2L);
		assertThat(result.<Integer>matchedOptionValue("--threads", 0)).isEqualTo(4);
		assertThat(result.matchedPositionals()).hasSize(1);
	}
}
