package org.dandiarchive.archive.core.dao;

import org.dandiarchive.archive.core.task.TaskStatus;
import org.dandiarchive.archive.types.ValidationStatus;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.spi.JdbiPlugin;

import java.sql.Types;
import java.util.Optional;
import java.util.function.IntFunction;
import java.util.function.ToIntFunction;

/**
 * Stores the archive's status enums as SMALLINT codes rather than names.
 * Installed on every {@link Jdbi} the archive builds, so DAOs bind and map them without annotations.
 */
public class ArchiveColumnTypesPlugin implements JdbiPlugin {

    @Override
    public void customizeJdbi(Jdbi jdbi) {
        smallint(jdbi, ValidationStatus.class, ValidationStatus::id, ValidationStatus::fromId);
        smallint(jdbi, TaskStatus.class, TaskStatus::id, TaskStatus::fromId);
    }

    private static <E> void smallint(Jdbi jdbi, Class<E> type, ToIntFunction<E> toCode, IntFunction<E> fromCode) {
        jdbi.registerArgument((ArgumentFactory) (argType, value, config) -> {
            if (!type.equals(argType)) {
                return Optional.empty();
            }
            Argument argument = value == null
                    ? (position, statement, ctx) -> statement.setNull(position, Types.SMALLINT)
                    : (position, statement, ctx) ->
                            statement.setShort(position, (short) toCode.applyAsInt(type.cast(value)));
            return Optional.of(argument);
        });
        jdbi.registerColumnMapper(type, (rs, column, ctx) -> {
            short code = rs.getShort(column);
            return rs.wasNull() ? null : fromCode.apply(code);
        });
    }
}
