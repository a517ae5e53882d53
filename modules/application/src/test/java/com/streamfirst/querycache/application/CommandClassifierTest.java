package com.streamfirst.querycache.application;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class CommandClassifierTest {

    private final CommandClassifier classifier = new CommandClassifier();

    @ParameterizedTest
    @ValueSource(strings = {
        "  UPDATE Foo SET x=1",
        "insert into Products (Name) values ('a')",
        "DELETE FROM [dbo].[Orders] WHERE [Id] = @p0",
        "Create TABLE Audit (Id int)",
        "SET NOCOUNT ON;\nINSERT INTO [Posts] ([Title]) VALUES (@p0);",
        "SET NOCOUNT ON;\r\n    UPDATE [Posts] SET [Title] = @p0\r\n"
    })
    void testMutatingCommands(String commandText) {
        assertThat(classifier.isMutatingCommand(commandText)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "SELECT * FROM Foo",
        "SELECT [u].[Name] FROM [Users] AS [u]\nWHERE [u].[Updated] = 1",
        "EXEC usp_GetBlogData 1",
        "updated_at",
        "INSERTINTO Products"
    })
    void testReadCommands(String commandText) {
        assertThat(classifier.isMutatingCommand(commandText)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\n\t\n"})
    void testBlankCommandsAreNotMutating(String commandText) {
        assertThat(classifier.isMutatingCommand(commandText)).isFalse();
    }

    @Test
    void testVerbMustStartTheLine() {
        // a write wrapped in a CTE is not recognized, an accepted limitation of the heuristic
        assertThat(classifier.isMutatingCommand("WITH x AS (SELECT 1) UPDATE Foo SET y = 1")).isFalse();
    }
}
