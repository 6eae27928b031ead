package db.compiler.ir;

import db.compiler.catalog.DataType;

/** Literal with its type already resolved. */
public sealed interface IrValue permits IrValue.NumberValue, IrValue.StringValue {

    DataType type();

    record NumberValue(double value) implements IrValue {
        @Override
        public DataType type() { return DataType.NUMBER; }
    }

    record StringValue(String value) implements IrValue {
        @Override
        public DataType type() { return DataType.STRING; }
    }
}
