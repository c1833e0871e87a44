package skill.swap.platform.config.typehandler;

import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;
import skill.swap.platform.enums.SwapRequestStatus;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * MyBatis TypeHandler for SwapRequestStatus enum
 * Maps between SwapRequestStatus enum and VARCHAR database column
 */
@MappedTypes(SwapRequestStatus.class)
public class SwapRequestStatusTypeHandler extends BaseTypeHandler<SwapRequestStatus> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, SwapRequestStatus parameter, JdbcType jdbcType) throws SQLException {
        ps.setString(i, parameter.name());
    }

    @Override
    public SwapRequestStatus getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return toStatus(rs.getString(columnName));
    }

    @Override
    public SwapRequestStatus getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return toStatus(rs.getString(columnIndex));
    }

    @Override
    public SwapRequestStatus getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return toStatus(cs.getString(columnIndex));
    }

    private SwapRequestStatus toStatus(String value) {
        return value == null ? null : SwapRequestStatus.valueOf(value);
    }
}
